package com.example.shab;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class OfficeContact extends Contact {
    private String officeId;

    @Override
    public ContactType getType() {
        return ContactType.OFFICE;
    }

    public OfficeContact copy() {
        OfficeContact c = new OfficeContact();
        c.setOfficeId(officeId);
        c.setName(getName());
        c.setAddress(getAddress());
        c.setPostalCode(getPostalCode());
        c.setCity(getCity());
        c.setPhone(getPhone());
        c.setEmail(getEmail());
        c.setContainsPostOfficeBox(getContainsPostOfficeBox());
        c.setPostOfficeBox(getPostOfficeBox());
        return c;
    }
}
