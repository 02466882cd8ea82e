package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.profit_dashboard.dtos.CostRuleDTO;
import com.tartaritech.profit_dashboard.dtos.MatchConditionDTO;
import com.tartaritech.profit_dashboard.dtos.ProfileTestRequestDTO;
import com.tartaritech.profit_dashboard.dtos.ProfileTestResponseDTO;
import com.tartaritech.profit_dashboard.dtos.ShippingProfileDTO;
import com.tartaritech.profit_dashboard.dtos.ShippingProfileUpdateDTO;
import com.tartaritech.profit_dashboard.entities.LineItem;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.exceptions.ResourceNotFoundException;
import com.tartaritech.profit_dashboard.repositories.ShippingProfileRepository;
import com.tartaritech.profit_dashboard.utils.CustomUserUtil;

@Service
public class ShippingProfileService {

    private final ShippingProfileRepository shippingProfileRepository;
    private final ShippingRuleMatcher shippingRuleMatcher;
    private final ShippingCostCalculator shippingCostCalculator;
    private final CustomUserUtil customUserUtil;
    private final Logger logger = LoggerFactory.getLogger(ShippingProfileService.class);

    public ShippingProfileService(ShippingProfileRepository shippingProfileRepository,
            ShippingRuleMatcher shippingRuleMatcher,
            ShippingCostCalculator shippingCostCalculator,
            CustomUserUtil customUserUtil) {
        this.shippingProfileRepository = shippingProfileRepository;
        this.shippingRuleMatcher = shippingRuleMatcher;
        this.shippingCostCalculator = shippingCostCalculator;
        this.customUserUtil = customUserUtil;
    }

    @Transactional(readOnly = true)
    public List<ShippingProfileDTO> getAllProfiles(boolean activeOnly) {
        logger.info("Fetching shipping profiles (activeOnly={})", activeOnly);
        List<ShippingProfile> profiles = activeOnly
                ? shippingProfileRepository.findByActiveTrueOrderByPriorityAscCreatedAtAscIdAsc()
                : shippingProfileRepository.findAllByOrderByPriorityAscCreatedAtAscIdAsc();
        return profiles.stream()
                .map(ShippingProfileDTO::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ShippingProfileDTO getProfile(Long id) {
        return new ShippingProfileDTO(findProfile(id));
    }

    @Transactional
    public ShippingProfileDTO createProfile(ShippingProfileDTO dto) {
        logger.info("Creating shipping profile: {}", dto.getName());

        ShippingProfile entity = dto.toEntity();
        entity.setUpdatedBy(customUserUtil.getLoggedUser());

        ShippingProfile saved = shippingProfileRepository.save(entity);
        logger.info("Shipping profile created successfully: {} (id={})", saved.getName(), saved.getId());

        return new ShippingProfileDTO(saved);
    }

    /**
     * Applies only the fields present in the request. Stored estimates are not touched; they
     * change on the next recompute.
     */
    @Transactional
    public ShippingProfileDTO updateProfile(Long id, ShippingProfileUpdateDTO dto) {
        logger.info("Updating shipping profile: {}", id);

        ShippingProfile entity = findProfile(id);

        if (dto.getName() != null) {
            entity.setName(dto.getName());
        }
        if (dto.getDescription() != null) {
            entity.setDescription(dto.getDescription());
        }
        if (dto.getPriority() != null) {
            entity.setPriority(dto.getPriority());
        }
        if (dto.getActive() != null) {
            entity.setActive(dto.getActive());
        }
        if (dto.getDefaultProfile() != null) {
            entity.setDefaultProfile(dto.getDefaultProfile());
        }
        if (dto.getMatchCondition() != null) {
            entity.setMatchCondition(dto.getMatchCondition().toEntity());
        }
        if (dto.getCostRule() != null) {
            entity.setCostRule(dto.getCostRule().toEntity());
        }
        entity.setUpdatedBy(customUserUtil.getLoggedUser());

        ShippingProfile updated = shippingProfileRepository.save(entity);
        logger.info("Shipping profile updated successfully: {}", updated.getId());

        return new ShippingProfileDTO(updated);
    }

    @Transactional
    public void deleteProfile(Long id) {
        logger.info("Deleting shipping profile: {}", id);

        if (!shippingProfileRepository.existsById(id)) {
            throw new ResourceNotFoundException("Shipping profile not found: " + id);
        }

        shippingProfileRepository.deleteById(id);
        logger.info("Shipping profile deleted successfully: {}", id);
    }

    /**
     * Runs an unsaved profile against a single sample item.
     */
    public ProfileTestResponseDTO testProfile(ProfileTestRequestDTO request) {
        ShippingProfile profile = request.getProfile().toEntity();
        ProfileTestRequestDTO.TestData data = request.getTestData();

        int quantity = data.getQuantity() != null ? data.getQuantity() : 1;
        LineItem sample = LineItem.create(
                data.getProductTitle() != null ? data.getProductTitle() : "",
                data.getVariantTitle(),
                quantity,
                BigDecimal.ZERO);

        boolean matched = shippingRuleMatcher.matches(profile.getMatchCondition(), sample);
        BigDecimal cost = null;
        if (matched) {
            cost = shippingCostCalculator.calculate(profile,
                    new ShippingCostInput(data.getOrderSubtotal(), quantity, data.getShippingCharged()));
        }

        logger.debug("Profile test for '{}': matched={}, cost={}", data.getProductTitle(), matched, cost);
        return new ProfileTestResponseDTO(matched, cost,
                new MatchConditionDTO(profile.getMatchCondition()),
                new CostRuleDTO(profile.getCostRule()));
    }

    private ShippingProfile findProfile(Long id) {
        return shippingProfileRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Shipping profile not found: " + id));
    }
}
