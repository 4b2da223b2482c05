package com.example.shab;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Country {
    private String isoCode;
    /** Same four keys as the publication title. */
    private Map<String, String> name;
}
