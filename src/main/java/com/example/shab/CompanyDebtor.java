package com.example.shab;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CompanyDebtor extends Debtor {
    private String name;
    private String legalForm;
    private String uid;
    private String canton;

    @Override
    public DebtorType getType() {
        return DebtorType.COMPANY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCompany(this);
    }
}
