package com.example.shab;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationOffice {
    private String id;
    private String displayName;
    private String street;
    private String streetNumber;
    private String swissZipCode;
    private String town;
    private boolean containsPostOfficeBox;
    private PostOfficeBox postOfficeBox;
}
