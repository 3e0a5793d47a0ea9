package br.edu.ifba.query;

import br.edu.ifba.videorag.generation.QueryResponse;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/api/v1/query")
public class QueryResources {

    @Inject
    QueryService queryService;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public QueryResponse query(@Valid @NotNull final QueryRequest request) {
        return queryService.query(request.query());
    }
}
