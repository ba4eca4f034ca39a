package search;

public class InvalidBudgetException extends IllegalArgumentException {

    public InvalidBudgetException(int budget) {
        super("mismatch budget must be non-negative, got " + budget);
    }
}
