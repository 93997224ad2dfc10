package dev.repodocs.exception;

public class ProjectNotFoundException extends RuntimeException {
    public ProjectNotFoundException(String slug) {
        super("No project with slug " + slug);
    }
}
