package projecttalus.domain.search;

public enum SearchStatus {
    FOUND,
    NO_VALID_CIRCLE,
    CANCELLED
}
