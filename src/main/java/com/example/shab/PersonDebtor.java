package com.example.shab;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PersonDebtor extends Debtor {
    private String name;
    private String prename;
    private LocalDate dateOfBirth;
    private Country countryOfOrigin;

    @Override
    public DebtorType getType() {
        return DebtorType.PERSON;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPerson(this);
    }
}
