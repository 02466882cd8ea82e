package com.tartaritech.profit_dashboard.entities;

import com.tartaritech.profit_dashboard.enums.MatchField;
import com.tartaritech.profit_dashboard.enums.MatchOperator;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Embeddable
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode
public class MatchCondition {

    @Enumerated(EnumType.STRING)
    @Column(name = "match_field", nullable = false, length = 32)
    private MatchField field;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_operator", nullable = false, length = 32)
    private MatchOperator operator = MatchOperator.CONTAINS;

    @Column(name = "match_value", nullable = false)
    private String value;

    @Column(name = "match_case_sensitive", nullable = false)
    private boolean caseSensitive;
}
