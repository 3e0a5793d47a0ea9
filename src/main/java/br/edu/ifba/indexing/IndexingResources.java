package br.edu.ifba.indexing;

import br.edu.ifba.videorag.indexing.JobStatus;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/api/v1/indexing")
public class IndexingResources {

    @Inject
    IndexingJobService jobService;

    @POST
    @Path("/start")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response start(@Valid @NotNull final IndexingRequest request) {
        final IndexingResponse response = jobService.submit(request.videoPath());
        return Response.accepted(response).build();
    }

    @GET
    @Path("/status/{jobId}")
    @Produces(MediaType.APPLICATION_JSON)
    public JobStatus status(@PathParam("jobId") final String jobId) {
        return jobService.status(jobId);
    }
}
