package br.edu.ifba.indexing;

public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(final String jobId) {
        super("Job with ID '" + jobId + "' not found. It may have expired or never existed.");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
