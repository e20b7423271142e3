package com.flagship.ledger_query.ledger;

/**
 * Type of the payment method a ledger entry was paid with.
 * Entries without a payment method carry {@code null}.
 */
public enum PaymentMethodType {
    ALIPAY,
    CREDITCARD,
    PREPAID,
    PAYMENT,
    SUBSCRIPTION,
    COLLECTIVE,
    GIFTCARD,
    ADAPTIVE,
    MANUAL,
    CRYPTO,
    PAYMENT_INTENT,
    US_BANK_ACCOUNT,
    SEPA_DEBIT,
    BACS_DEBIT,
    BANCONTACT,
    LINK
}
