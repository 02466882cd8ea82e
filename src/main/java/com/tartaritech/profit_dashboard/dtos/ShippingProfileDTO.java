package com.tartaritech.profit_dashboard.dtos;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ShippingProfileDTO {

    private Long id;

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    private String description;

    private Integer priority = 100;

    @JsonProperty("is_active")
    private boolean active = true;

    @JsonProperty("is_default")
    private boolean defaultProfile;

    @NotNull(message = "Match condition is required")
    @Valid
    private MatchConditionDTO matchCondition;

    @NotNull(message = "Cost rule is required")
    @Valid
    private CostRuleDTO costRule;

    private Instant createdAt;

    private Instant updatedAt;

    public ShippingProfileDTO(ShippingProfile entity) {
        this.id = entity.getId();
        this.name = entity.getName();
        this.description = entity.getDescription();
        this.priority = entity.getPriority();
        this.active = entity.isActive();
        this.defaultProfile = entity.isDefaultProfile();
        this.matchCondition = entity.getMatchCondition() != null ? new MatchConditionDTO(entity.getMatchCondition()) : null;
        this.costRule = entity.getCostRule() != null ? new CostRuleDTO(entity.getCostRule()) : null;
        this.createdAt = entity.getCreatedAt();
        this.updatedAt = entity.getUpdatedAt();
    }

    public ShippingProfile toEntity() {
        ShippingProfile profile = new ShippingProfile();
        profile.setName(name);
        profile.setDescription(description);
        profile.setPriority(priority != null ? priority : 100);
        profile.setActive(active);
        profile.setDefaultProfile(defaultProfile);
        profile.setMatchCondition(matchCondition.toEntity());
        profile.setCostRule(costRule.toEntity());
        return profile;
    }
}
