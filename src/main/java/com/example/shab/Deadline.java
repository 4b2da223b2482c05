package com.example.shab;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Circulation or registration window of an auction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Deadline {
    private LocalDate entryDeadline;
    private String commentEntryDeadline;
}
