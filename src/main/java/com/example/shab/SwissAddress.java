package com.example.shab;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SwissAddress {
    private String street;
    private String houseNumber;
    private String swissZipCode;
    private String town;

    /** "street houseNumber", skipping whichever part is missing. */
    public String streetLine() {
        return XmlSupport.joinNonBlank(" ", street, houseNumber);
    }
}
