package com.flagship.ledger_query.query.search;

import com.flagship.ledger_query.query.predicate.Clause;
import com.flagship.ledger_query.query.predicate.Clauses;
import com.flagship.ledger_query.query.predicate.Column;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Search condition builder.
 *
 * Rules, first match wins:
 * <ul>
 *   <li>{@code 123} or {@code #123}: exact match on id fields only</li>
 *   <li>{@code @slug}: exact match on slug fields only</li>
 *   <li>anything else: substring match on slug and text fields, plus an amount match
 *       when the term is a decimal number</li>
 * </ul>
 */
@Component
public class DefaultSearchConditionBuilder implements SearchConditionBuilder {

    static final int MAX_TERM_LENGTH = 1000;

    private static final Pattern ID_PATTERN = Pattern.compile("^#?\\d+$");
    private static final Pattern AMOUNT_PATTERN = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public List<Clause> buildConditions(String searchTerm, SearchFields fields) {
        String term = sanitize(searchTerm);
        if (term.isEmpty()) {
            return List.of();
        }
        String termWithoutWhitespace = WHITESPACE.matcher(term).replaceAll("");

        if (!fields.getIdFields().isEmpty() && ID_PATTERN.matcher(term).matches()) {
            Optional<Long> id = parseId(term.startsWith("#") ? term.substring(1) : term);
            if (id.isPresent()) {
                return fields.getIdFields().stream()
                    .map(column -> Clauses.eq(column, id.get()))
                    .toList();
            }
        }

        if (!fields.getSlugFields().isEmpty() && term.startsWith("@")) {
            String slug = termWithoutWhitespace.replaceFirst("^@+", "");
            return fields.getSlugFields().stream()
                .map(column -> Clauses.eq(column, slug))
                .toList();
        }

        List<Clause> conditions = new ArrayList<>();
        for (Column column : fields.getSlugFields()) {
            conditions.add(Clauses.contains(column, termWithoutWhitespace));
        }
        for (Column column : fields.getTextFields()) {
            conditions.add(Clauses.contains(column, term));
        }
        if (!fields.getAmountFields().isEmpty() && AMOUNT_PATTERN.matcher(term).matches()) {
            parseAmountInCents(term).ifPresent(amountInCents -> {
                for (Column column : fields.getAmountFields()) {
                    conditions.add(Clauses.absEq(column, amountInCents));
                }
            });
        }
        return conditions;
    }

    // Digits beyond the long range are free text (card or bank references), not ids.
    private static Optional<Long> parseId(String digits) {
        try {
            return Optional.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Long> parseAmountInCents(String term) {
        try {
            return Optional.of(new BigDecimal(term)
                .movePointRight(2)
                .setScale(0, RoundingMode.HALF_UP)
                .abs()
                .longValueExact());
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    static String sanitize(String searchTerm) {
        if (searchTerm == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(searchTerm.trim()).replaceAll(" ");
        return collapsed.length() > MAX_TERM_LENGTH ? collapsed.substring(0, MAX_TERM_LENGTH) : collapsed;
    }
}
