package br.edu.ifba.library;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

@Path("/api/v1/library")
public class LibraryResources {

    @Inject
    LibraryService libraryService;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public List<VideoLibraryItem> list(@QueryParam("search") final String search) {
        return libraryService.list(search);
    }
}
