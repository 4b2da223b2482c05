package com.example.shab;

import lombok.Data;

/**
 * Debtor of a debt-enforcement auction. Exactly one concrete variant exists per debtor,
 * and {@link #getType()} always names that variant.
 */
@Data
public abstract class Debtor {
    private ResidenceType residence;
    /** Only set when {@link #residence} is {@link ResidenceType#SWITZERLAND}. */
    private SwissAddress swissAddress;
    private String displayAddress;
    private String city;
    private String postalCode;

    public abstract DebtorType getType();

    public abstract String getName();

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitPerson(PersonDebtor person);

        R visitCompany(CompanyDebtor company);
    }

    public enum DebtorType {
        PERSON("person"),
        COMPANY("company");

        private final String code;

        DebtorType(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    public enum ResidenceType {
        SWITZERLAND("switzerland"),
        FOREIGN("foreign");

        private final String code;

        ResidenceType(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        /**
         * Maps the source's selectType value; anything other than "switzerland" is foreign.
         */
        public static ResidenceType fromCode(String code) {
            if (code == null || code.isBlank()) {
                return null;
            }
            return SWITZERLAND.code.equalsIgnoreCase(code.trim()) ? SWITZERLAND : FOREIGN;
        }
    }
}
