package com.example.shab;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PostOfficeBox {
    private String number;
    private String zipCode;
    private String town;
}
