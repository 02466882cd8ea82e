package com.tartaritech.profit_dashboard.services;

import static com.tartaritech.profit_dashboard.services.ShippingTestData.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.tartaritech.profit_dashboard.dtos.CostRuleDTO;
import com.tartaritech.profit_dashboard.dtos.MatchConditionDTO;
import com.tartaritech.profit_dashboard.dtos.ProfileTestRequestDTO;
import com.tartaritech.profit_dashboard.dtos.ProfileTestResponseDTO;
import com.tartaritech.profit_dashboard.dtos.ShippingProfileDTO;
import com.tartaritech.profit_dashboard.dtos.ShippingProfileUpdateDTO;
import com.tartaritech.profit_dashboard.entities.CostRule;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.enums.CostRuleType;
import com.tartaritech.profit_dashboard.enums.MatchField;
import com.tartaritech.profit_dashboard.enums.MatchOperator;
import com.tartaritech.profit_dashboard.exceptions.ResourceNotFoundException;
import com.tartaritech.profit_dashboard.exceptions.ShippingRuleConfigurationException;
import com.tartaritech.profit_dashboard.repositories.ShippingProfileRepository;
import com.tartaritech.profit_dashboard.utils.CustomUserUtil;

@ExtendWith(MockitoExtension.class)
@DisplayName("ShippingProfileService Unit Tests")
class ShippingProfileServiceTest {

    @Mock
    private ShippingProfileRepository shippingProfileRepository;

    @Mock
    private CustomUserUtil customUserUtil;

    private ShippingProfileService service;

    @BeforeEach
    void setup() {
        service = new ShippingProfileService(shippingProfileRepository, new ShippingRuleMatcher(),
                new ShippingCostCalculator(), customUserUtil);
    }

    private ShippingProfileDTO shirtsDto() {
        ShippingProfileDTO dto = new ShippingProfileDTO();
        dto.setName("Shirts");
        dto.setPriority(10);
        dto.setMatchCondition(new MatchConditionDTO(MatchField.PRODUCT_TITLE, MatchOperator.CONTAINS, "shirt", false));
        dto.setCostRule(new CostRuleDTO(CostRuleType.PER_ITEM, null, money("2.00"), null, null));
        return dto;
    }

    @Nested
    @DisplayName("CRUD")
    class CrudTests {

        @Test
        @DisplayName("Should stamp the current user when creating")
        void shouldCreateWithAuditUser() {
            when(customUserUtil.getLoggedUser()).thenReturn("admin");
            when(shippingProfileRepository.save(any(ShippingProfile.class))).thenAnswer(inv -> {
                ShippingProfile p = inv.getArgument(0);
                p.setId(11L);
                return p;
            });

            ShippingProfileDTO created = service.createProfile(shirtsDto());

            ArgumentCaptor<ShippingProfile> captor = ArgumentCaptor.forClass(ShippingProfile.class);
            verify(shippingProfileRepository).save(captor.capture());
            assertEquals("admin", captor.getValue().getUpdatedBy());
            assertEquals(11L, created.getId());
            assertEquals(CostRuleType.PER_ITEM, created.getCostRule().getType());
        }

        @Test
        @DisplayName("Should only change the fields present in a partial update")
        void shouldApplyPartialUpdate() {
            ShippingProfile existing = profile(3, "Shirts", 10, "shirt", CostRule.perItem(money("2.00")));
            when(shippingProfileRepository.findById(3L)).thenReturn(Optional.of(existing));
            when(shippingProfileRepository.save(existing)).thenReturn(existing);
            when(customUserUtil.getLoggedUser()).thenReturn("admin");

            ShippingProfileUpdateDTO update = new ShippingProfileUpdateDTO();
            update.setPriority(1);
            update.setActive(false);

            ShippingProfileDTO result = service.updateProfile(3L, update);

            assertEquals(1, result.getPriority());
            assertFalse(result.isActive());
            assertEquals("Shirts", result.getName());
            assertEquals(money("2.00"), result.getCostRule().getPerItemCost());
        }

        @Test
        @DisplayName("Should throw not found when updating an unknown profile")
        void shouldThrowOnUnknownUpdate() {
            when(shippingProfileRepository.findById(404L)).thenReturn(Optional.empty());

            assertThrows(ResourceNotFoundException.class,
                    () -> service.updateProfile(404L, new ShippingProfileUpdateDTO()));
        }

        @Test
        @DisplayName("Should throw not found when deleting an unknown profile")
        void shouldThrowOnUnknownDelete() {
            when(shippingProfileRepository.existsById(404L)).thenReturn(false);

            assertThrows(ResourceNotFoundException.class, () -> service.deleteProfile(404L));
            verify(shippingProfileRepository, never()).deleteById(any());
        }

        @Test
        @DisplayName("Should list only active profiles when asked")
        void shouldListActiveOnly() {
            when(shippingProfileRepository.findByActiveTrueOrderByPriorityAscCreatedAtAscIdAsc())
                    .thenReturn(List.of(profile(1, "Shirts", 10, "shirt", CostRule.fixed(money("5.00")))));

            List<ShippingProfileDTO> profiles = service.getAllProfiles(true);

            assertEquals(1, profiles.size());
            verify(shippingProfileRepository, never()).findAllByOrderByPriorityAscCreatedAtAscIdAsc();
        }
    }

    @Nested
    @DisplayName("testProfile")
    class DryRunTests {

        @Test
        @DisplayName("Should compute the cost for a matching sample")
        void shouldComputeForMatch() {
            ProfileTestRequestDTO.TestData data = new ProfileTestRequestDTO.TestData("Red Shirt", null, 3, money("60.00"), money("9.00"));

            ProfileTestResponseDTO response = service.testProfile(new ProfileTestRequestDTO(shirtsDto(), data));

            assertTrue(response.isMatched());
            assertEquals(money("6.00"), response.getCalculatedCost());
            verifyNoInteractions(shippingProfileRepository);
        }

        @Test
        @DisplayName("Should not compute a cost when the sample does not match")
        void shouldSkipCostWhenNotMatched() {
            ProfileTestRequestDTO.TestData data = new ProfileTestRequestDTO.TestData("Mug", null, 1, money("10.00"), money("5.00"));

            ProfileTestResponseDTO response = service.testProfile(new ProfileTestRequestDTO(shirtsDto(), data));

            assertFalse(response.isMatched());
            assertNull(response.getCalculatedCost());
        }

        @Test
        @DisplayName("Should surface a misconfigured cost rule")
        void shouldSurfaceMisconfiguration() {
            ShippingProfileDTO dto = shirtsDto();
            dto.setCostRule(new CostRuleDTO(CostRuleType.FIXED, null, null, null, null));
            ProfileTestRequestDTO.TestData data = new ProfileTestRequestDTO.TestData("Red Shirt", null, 1, money("10.00"), money("5.00"));

            assertThrows(ShippingRuleConfigurationException.class,
                    () -> service.testProfile(new ProfileTestRequestDTO(dto, data)));
        }
    }
}
