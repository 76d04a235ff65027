package com.llestrade.core.errors;

/**
 * Text cannot be made to fit the model's token budget.
 */
public class BudgetExceededException extends AnalysisException {

    private final int tokens;
    private final int budget;

    public BudgetExceededException(String message, int tokens, int budget) {
        super(message + " (" + tokens + " tokens, budget " + budget + ")");
        this.tokens = tokens;
        this.budget = budget;
    }

    public int getTokens() {
        return tokens;
    }

    public int getBudget() {
        return budget;
    }
}
