package com.example.mltranslation.exception;

/**
 * 金額無效：不大於 0、超過單次上限，或加值後餘額溢位
 */
public class InvalidAmountException extends BusinessRuleException {

    private final long amount;

    public InvalidAmountException(long amount) {
        super(String.format("Amount must be > 0: %d", amount));
        this.amount = amount;
    }

    public InvalidAmountException(String message, long amount) {
        super(message);
        this.amount = amount;
    }

    public long getAmount() {
        return amount;
    }
}
