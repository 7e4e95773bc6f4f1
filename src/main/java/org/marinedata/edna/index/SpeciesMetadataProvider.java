/**
 *
 */
package org.marinedata.edna.index;

import java.util.Optional;

/**
 * This interface describes a source of species display information keyed by species ID.
 *
 */
public interface SpeciesMetadataProvider {

    /**
     * Look up the metadata for a species.
     *
     * @param speciesId		ID of the species
     *
     * @return the metadata for the species, or an empty result if it is not known
     */
    Optional<SpeciesMetadata> lookup(String speciesId);

    /**
     * @return the metadata for a species, with all-unknown values if the species is not known
     *
     * @param speciesId		ID of the species
     */
    default SpeciesMetadata resolve(String speciesId) {
        return this.lookup(speciesId).orElseGet(() -> SpeciesMetadata.unknown(speciesId));
    }

    /**
     * @return a provider that knows no species
     */
    static SpeciesMetadataProvider empty() {
        return x -> Optional.empty();
    }

}
