package com.flagship.accrual_ledger.ledger;

import com.flagship.accrual_ledger.exception.ConfigurationException;
import com.flagship.accrual_ledger.ledger.Account.AccountType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves posting roles to destination accounts.
 *
 * Built once at startup; every role must be mapped, so lookups never fail mid-run.
 */
public class AccountMapping {

    private final Map<AccountRole, Account> roles;
    private final Map<String, Account> taxExpense;
    private final Map<String, Account> taxLiability;
    private final Map<String, Account> withholding;

    private AccountMapping(Map<AccountRole, Account> roles,
                           Map<String, Account> taxExpense,
                           Map<String, Account> taxLiability,
                           Map<String, Account> withholding) {
        this.roles = Collections.unmodifiableMap(roles);
        this.taxExpense = Collections.unmodifiableMap(taxExpense);
        this.taxLiability = Collections.unmodifiableMap(taxLiability);
        this.withholding = Collections.unmodifiableMap(withholding);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Account get(AccountRole role) {
        return roles.get(role);
    }

    public Account taxExpense(String category) {
        Account account = taxExpense.get(category);
        if (account == null) {
            throw new IllegalArgumentException("No tax expense account for category " + category);
        }
        return account;
    }

    public Account taxLiability(String category) {
        Account account = taxLiability.get(category);
        if (account == null) {
            throw new IllegalArgumentException("No tax liability account for category " + category);
        }
        return account;
    }

    public Optional<Account> withholding(String category) {
        return Optional.ofNullable(withholding.get(category));
    }

    /**
     * Tax categories whose reserve is moved to a withholding account on payout, in
     * configuration order. Empty when payouts go to the bank in full.
     */
    public List<String> getWithholdingCategories() {
        return List.copyOf(withholding.keySet());
    }

    public static class Builder {
        private final Map<AccountRole, Account> roles = new EnumMap<>(AccountRole.class);
        private final Map<String, Account> taxExpense = new LinkedHashMap<>();
        private final Map<String, Account> taxLiability = new LinkedHashMap<>();
        private final Map<String, Account> withholding = new LinkedHashMap<>();

        public Builder role(AccountRole role, String identifier) {
            roles.put(role, new Account(requireName(role.name(), identifier), role.getAccountType()));
            return this;
        }

        public Builder taxAccounts(String category, String expenseIdentifier, String liabilityIdentifier) {
            taxExpense.put(category,
                    new Account(requireName(category + " expense", expenseIdentifier), AccountType.EXPENSE));
            taxLiability.put(category,
                    new Account(requireName(category + " liability", liabilityIdentifier), AccountType.LIABILITY));
            return this;
        }

        public Builder withholdingAccount(String category, String identifier) {
            withholding.put(category,
                    new Account(requireName(category + " withholding", identifier), AccountType.ASSET));
            return this;
        }

        /**
         * @throws ConfigurationException if any role is left unmapped or a withholding
         *                                account belongs to no tax category
         */
        public AccountMapping build() {
            for (AccountRole role : AccountRole.values()) {
                if (!roles.containsKey(role)) {
                    throw new ConfigurationException("No account mapped for role " + role);
                }
            }
            for (String category : withholding.keySet()) {
                if (!taxLiability.containsKey(category)) {
                    throw new ConfigurationException("Withholding account for unknown tax category " + category);
                }
            }
            return new AccountMapping(new EnumMap<>(roles), new LinkedHashMap<>(taxExpense),
                    new LinkedHashMap<>(taxLiability), new LinkedHashMap<>(withholding));
        }

        private static String requireName(String what, String identifier) {
            if (identifier == null || identifier.isBlank()) {
                throw new ConfigurationException("Account name for " + what + " is blank");
            }
            return identifier.trim();
        }
    }
}
