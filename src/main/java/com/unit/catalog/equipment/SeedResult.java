package com.unit.catalog.equipment;

import java.util.List;

/**
 * Outcome of applying an equipment statistics seed file.
 *
 * @param entries   entries read from the file
 * @param updated   equipment rows whose statistics changed
 * @param aliasHits entries matched through the naming-convention fallback
 * @param unchanged entries whose equipment row already carried the values
 * @param notFound  slugs with no equipment row
 */
public record SeedResult(int entries, int updated, int aliasHits, int unchanged, List<String> notFound) {

    public SeedResult {
        notFound = notFound != null ? List.copyOf(notFound) : List.of();
    }

    @Override
    public String toString() {
        return "SeedResult{entries=" + entries + ", updated=" + updated + ", aliasHits=" + aliasHits
                + ", unchanged=" + unchanged + ", notFound=" + notFound.size() + '}';
    }
}
