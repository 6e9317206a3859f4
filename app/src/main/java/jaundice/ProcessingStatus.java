package jaundice;

// Terminal state of a single article worker.
public enum ProcessingStatus {
    OK,
    FETCH_ERROR,
    PARSING_ERROR,
    TIMEOUT
}
