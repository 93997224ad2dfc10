package dev.repodocs.domain.valueobject;

import java.util.Locale;

/**
 * Persistence key and public address of a generated site.
 *
 * <p>Deterministic in (repoName, ownerIdentity): regenerating the same repository for the
 * same owner lands on the same slug, so the stored artifact is overwritten, not duplicated.
 * The owner prefix keeps two owners of identically named repositories apart.
 */
public record Slug(String value) {

    /** Width of the {@code projects.slug} column. */
    public static final int MAX_LENGTH = 200;
    private static final int OWNER_PREFIX_LENGTH = 8;
    private static final int MAX_REPO_PART_LENGTH = MAX_LENGTH - OWNER_PREFIX_LENGTH - 1;

    public Slug {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("slug required");
    }

    public static Slug derive(String repoName, String ownerIdentity) {
        if (ownerIdentity == null || ownerIdentity.isBlank()) {
            throw new IllegalArgumentException("ownerIdentity required");
        }
        String repoPart = truncate(slugify(repoName));
        if (repoPart.isEmpty()) repoPart = "project";
        String owner = ownerIdentity.substring(0, Math.min(OWNER_PREFIX_LENGTH, ownerIdentity.length()));
        String ownerPart = slugify(owner);
        return new Slug(ownerPart.isEmpty() ? repoPart : repoPart + "-" + ownerPart);
    }

    static String slugify(String name) {
        if (name == null) return "";
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
    }

    private static String truncate(String repoPart) {
        if (repoPart.length() <= MAX_REPO_PART_LENGTH) return repoPart;
        return repoPart.substring(0, MAX_REPO_PART_LENGTH).replaceAll("-+$", "");
    }

    @Override
    public String toString() {
        return value;
    }
}
