package com.example.shab;

import lombok.Data;

/**
 * Point of contact for a publication: either the enforcement office or a named person.
 */
@Data
public abstract class Contact {
    private String name;
    private String address;
    private String postalCode;
    private String city;
    private String phone;
    private String email;
    private Boolean containsPostOfficeBox;
    private PostOfficeBox postOfficeBox;

    public abstract ContactType getType();

    /** Registration-office id for office contacts, null otherwise. */
    public abstract String getOfficeId();

    public enum ContactType {
        OFFICE("office"),
        PERSON("person");

        private final String code;

        ContactType(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }
}
