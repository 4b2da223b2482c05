package com.example.shab;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One auctioned object. The description is the source HTML, kept as-is; coordinates
 * are filled in later by geocoding and stay null after parsing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuctionObject {
    private String description;
    private Double latitude;
    private Double longitude;

    public AuctionObject(String description) {
        this.description = description;
    }
}
