package dev.repodocs.domain.valueobject;

/**
 * Who asked for a generation and for which repository. Bound once per relay lifetime.
 * A present owner identity is the only thing that makes a relay persist its result.
 */
public record GenerationSession(String ownerIdentity, String repoUrl, String repoName) {

    public GenerationSession {
        if (repoUrl == null || repoUrl.isBlank()) throw new IllegalArgumentException("repoUrl required");
        if (ownerIdentity != null && ownerIdentity.isBlank()) ownerIdentity = null;
        if (repoName == null || repoName.isBlank()) repoName = repoNameFromUrl(repoUrl);
    }

    public static GenerationSession anonymous(String repoUrl, String repoName) {
        return new GenerationSession(null, repoUrl, repoName);
    }

    public static GenerationSession ownedBy(String ownerIdentity, String repoUrl, String repoName) {
        return new GenerationSession(ownerIdentity, repoUrl, repoName);
    }

    public boolean requiresPersistence() {
        return ownerIdentity != null;
    }

    /**
     * Last path segment of the repository URL, without a trailing ".git".
     * "https://github.com/octocat/hello-world.git" → "hello-world".
     */
    static String repoNameFromUrl(String repoUrl) {
        String trimmed = repoUrl.strip();
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        if (trimmed.endsWith(".git")) trimmed = trimmed.substring(0, trimmed.length() - 4);
        int slash = trimmed.lastIndexOf('/');
        String name = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return name.isEmpty() ? trimmed : name;
    }
}
