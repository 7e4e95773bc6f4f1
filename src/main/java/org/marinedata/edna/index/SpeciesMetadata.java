/**
 *
 */
package org.marinedata.edna.index;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * This object contains the display information for a species.  Every field other than the species ID falls back
 * to {@link #UNKNOWN} when the source has no value for it.  Instances are only created through the static
 * factories, so the defaulting rule is applied in exactly one place.
 *
 * The attribute keys used by {@link #of(String, Map)} are the column names of the taxonomy files.
 *
 */
public class SpeciesMetadata {

    /** default value for missing fields */
    public static final String UNKNOWN = "Unknown";
    /** attribute key for the scientific name */
    public static final String SCIENTIFIC_NAME = "species";
    /** attribute key for the common name */
    public static final String COMMON_NAME = "common_name";
    /** attribute key for the kingdom */
    public static final String KINGDOM = "kingdom";
    /** attribute key for the phylum */
    public static final String PHYLUM = "phylum";
    /** attribute key for the class */
    public static final String CLASS = "class";
    /** attribute key for the order */
    public static final String ORDER = "order";
    /** attribute key for the family */
    public static final String FAMILY = "family";
    /** attribute key for the genus */
    public static final String GENUS = "genus";
    /** list of attribute keys, in display order */
    public static final String[] ATTRIBUTES = { SCIENTIFIC_NAME, COMMON_NAME, KINGDOM, PHYLUM, CLASS, ORDER,
            FAMILY, GENUS };

    // FIELDS
    /** species ID */
    private final String speciesId;
    /** scientific name */
    private final String scientificName;
    /** common name */
    private final String commonName;
    /** kingdom */
    private final String kingdom;
    /** phylum */
    private final String phylum;
    /** taxonomic class */
    private final String taxClass;
    /** taxonomic order */
    private final String order;
    /** family */
    private final String family;
    /** genus */
    private final String genus;

    /**
     * Construct a metadata record from an attribute map.
     *
     * @param speciesId		ID of the species
     * @param attributes	map of attribute keys to values
     */
    private SpeciesMetadata(String speciesId, Map<String, String> attributes) {
        this.speciesId = speciesId;
        this.scientificName = fill(attributes.get(SCIENTIFIC_NAME));
        this.commonName = fill(attributes.get(COMMON_NAME));
        this.kingdom = fill(attributes.get(KINGDOM));
        this.phylum = fill(attributes.get(PHYLUM));
        this.taxClass = fill(attributes.get(CLASS));
        this.order = fill(attributes.get(ORDER));
        this.family = fill(attributes.get(FAMILY));
        this.genus = fill(attributes.get(GENUS));
    }

    /**
     * Create a metadata record from an attribute map.  Missing or blank attributes are set to {@link #UNKNOWN}.
     *
     * @param speciesId		ID of the species
     * @param attributes	map of attribute keys to values
     *
     * @return the metadata record
     */
    public static SpeciesMetadata of(String speciesId, Map<String, String> attributes) {
        Objects.requireNonNull(speciesId, "Species ID is required for metadata.");
        return new SpeciesMetadata(speciesId, attributes);
    }

    /**
     * @return a metadata record for a species with no known information
     *
     * @param speciesId		ID of the species
     */
    public static SpeciesMetadata unknown(String speciesId) {
        return of(speciesId, Collections.emptyMap());
    }

    /**
     * @return the incoming value, or {@link #UNKNOWN} if it is missing or blank
     *
     * @param value		value to check
     */
    private static String fill(String value) {
        return (StringUtils.isBlank(value) ? UNKNOWN : value.strip());
    }

    /**
     * @return the value of the attribute with the specified key
     *
     * @param key	attribute key (one of {@link #ATTRIBUTES})
     */
    public String get(String key) {
        String retVal;
        switch (key) {
        case SCIENTIFIC_NAME :
            retVal = this.scientificName;
            break;
        case COMMON_NAME :
            retVal = this.commonName;
            break;
        case KINGDOM :
            retVal = this.kingdom;
            break;
        case PHYLUM :
            retVal = this.phylum;
            break;
        case CLASS :
            retVal = this.taxClass;
            break;
        case ORDER :
            retVal = this.order;
            break;
        case FAMILY :
            retVal = this.family;
            break;
        case GENUS :
            retVal = this.genus;
            break;
        default :
            throw new IllegalArgumentException("Invalid species attribute \"" + key + "\".");
        }
        return retVal;
    }

    /**
     * @return the species ID
     */
    public String getSpeciesId() {
        return this.speciesId;
    }

    /**
     * @return the scientific name
     */
    public String getScientificName() {
        return this.scientificName;
    }

    /**
     * @return the common name
     */
    public String getCommonName() {
        return this.commonName;
    }

    /**
     * @return the kingdom
     */
    public String getKingdom() {
        return this.kingdom;
    }

    /**
     * @return the phylum
     */
    public String getPhylum() {
        return this.phylum;
    }

    /**
     * @return the taxonomic class
     */
    public String getTaxClass() {
        return this.taxClass;
    }

    /**
     * @return the taxonomic order
     */
    public String getOrder() {
        return this.order;
    }

    /**
     * @return the family
     */
    public String getFamily() {
        return this.family;
    }

    /**
     * @return the genus
     */
    public String getGenus() {
        return this.genus;
    }

    @Override
    public String toString() {
        return this.speciesId + " (" + this.commonName + ", " + this.scientificName + ")";
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.speciesId, this.scientificName, this.commonName, this.kingdom, this.phylum,
                this.taxClass, this.order, this.family, this.genus);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SpeciesMetadata)) {
            return false;
        }
        SpeciesMetadata other = (SpeciesMetadata) obj;
        return this.speciesId.equals(other.speciesId) && this.scientificName.equals(other.scientificName)
                && this.commonName.equals(other.commonName) && this.kingdom.equals(other.kingdom)
                && this.phylum.equals(other.phylum) && this.taxClass.equals(other.taxClass)
                && this.order.equals(other.order) && this.family.equals(other.family)
                && this.genus.equals(other.genus);
    }

}
