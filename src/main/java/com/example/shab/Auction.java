package com.example.shab;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Auction {
    public static final String UNKNOWN_LOCATION = "Nicht angegeben";

    private String id;
    private LocalDate date;
    /** Null while the auction time is not yet determined. */
    private LocalTime time;
    private String location;
    private Deadline circulation;
    private Deadline registration;
    private List<AuctionObject> objects = new ArrayList<>();
}
