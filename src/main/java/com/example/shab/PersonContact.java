package com.example.shab;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PersonContact extends Contact {

    @Override
    public ContactType getType() {
        return ContactType.PERSON;
    }

    @Override
    public String getOfficeId() {
        return null;
    }
}
