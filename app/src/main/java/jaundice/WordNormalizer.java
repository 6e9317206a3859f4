package jaundice;

// Maps a word to its dictionary (lemma) form, lower-cased.
public interface WordNormalizer {

    String normalize(String word);

    // Whether normalize may be called from several workers at once.
    default boolean isThreadSafe() {
        return false;
    }
}
