/**
 *
 */
package org.marinedata.edna.match;

import org.marinedata.edna.kmers.KmerProfile;
import org.marinedata.edna.utils.ParseFailureException;

/**
 * This class performs strict validation of query sequences before they are submitted to the matcher.  The matcher
 * itself tolerates anything, but user-supplied sequences are expected to contain only A, C, G, T, and N.
 *
 */
public class SequenceValidator {

    /** message for an empty sequence */
    public static final String EMPTY_MESSAGE = "Sequence cannot be empty";
    /** message for a sequence with invalid characters */
    public static final String INVALID_MESSAGE = "Sequence contains invalid DNA bases. Only A, T, G, C, N are allowed";

    private SequenceValidator() { }

    /**
     * Normalize and validate a query sequence.
     *
     * @param sequence	incoming sequence
     *
     * @return the sequence, trimmed and converted to upper case
     *
     * @throws ParseFailureException if the sequence is empty or contains an invalid character
     */
    public static String validate(String sequence) throws ParseFailureException {
        String retVal = (sequence == null ? "" : KmerProfile.normalize(sequence));
        if (retVal.isEmpty())
            throw new ParseFailureException(EMPTY_MESSAGE);
        for (int i = 0; i < retVal.length(); i++) {
            char c = retVal.charAt(i);
            if (c != 'N' && ! KmerProfile.isBase(c))
                throw new ParseFailureException(INVALID_MESSAGE);
        }
        return retVal;
    }

}
