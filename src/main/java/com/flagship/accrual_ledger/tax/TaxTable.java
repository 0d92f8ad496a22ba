package com.flagship.accrual_ledger.tax;

import com.flagship.accrual_ledger.exception.ConfigurationException;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, validated set of tax categories. Read-only after construction.
 */
public class TaxTable {

    private final List<TaxCategory> categories;

    public TaxTable(List<TaxCategory> categories) {
        validate(categories);
        this.categories = List.copyOf(categories);
    }

    public List<TaxCategory> getCategories() {
        return categories;
    }

    private static void validate(List<TaxCategory> categories) {
        Set<String> names = new HashSet<>();
        for (TaxCategory category : categories) {
            if (category.getName() == null || category.getName().isBlank()) {
                throw new ConfigurationException("Tax category without a name");
            }
            if (!names.add(category.getName())) {
                throw new ConfigurationException("Duplicate tax category " + category.getName());
            }
            if (category instanceof FlatRateTaxCategory flat) {
                checkRate(flat.getName(), flat.getRate());
            } else if (category instanceof GraduatedTaxCategory graduated) {
                checkBrackets(graduated);
            }
        }
    }

    private static void checkBrackets(GraduatedTaxCategory category) {
        List<TaxBracket> brackets = category.getBrackets();
        if (brackets == null || brackets.isEmpty()) {
            throw new ConfigurationException("Tax category " + category.getName() + " has no brackets");
        }
        if (brackets.get(0).getLowerBound() != 0) {
            throw new ConfigurationException("First bracket of " + category.getName() + " must start at 0");
        }
        long previous = -1;
        for (TaxBracket bracket : brackets) {
            if (bracket.getLowerBound() <= previous) {
                throw new ConfigurationException("Brackets of " + category.getName()
                        + " must have strictly ascending lower bounds");
            }
            checkRate(category.getName(), bracket.getRate());
            previous = bracket.getLowerBound();
        }
    }

    private static void checkRate(String name, BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new ConfigurationException("Tax rate of " + name + " must be between 0 and 1, was " + rate);
        }
    }
}
