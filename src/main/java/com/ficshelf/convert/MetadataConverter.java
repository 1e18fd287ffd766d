package com.ficshelf.convert;

import com.ficshelf.models.CanonicalMetadata;
import com.ficshelf.models.RawMetadata;
import com.ficshelf.target.TargetIdentity;

/**
 * Turns one site's raw metadata into canonical form. Implementations are pure
 * functions: they never modify {@code raw} and keep no state.
 */
@FunctionalInterface
public interface MetadataConverter {

    /**
     * @param raw    the stored metadata
     * @param origin identity of the stored target, used to fill in a missing
     *               story id or site abbreviation; may be null
     * @throws com.ficshelf.errors.MalformedSourceException if an identity-bearing
     *         value is present but unusable
     */
    CanonicalMetadata convert(RawMetadata raw, TargetIdentity origin);

    default CanonicalMetadata convert(RawMetadata raw) {
        return convert(raw, null);
    }
}
