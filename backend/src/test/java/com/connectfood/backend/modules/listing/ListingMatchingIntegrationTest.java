package com.connectfood.backend.modules.listing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.connectfood.backend.modules.listing.infrastructure.persistence.ListingRepository;
import com.connectfood.backend.modules.matching.infrastructure.persistence.MatchRepository;
import com.connectfood.backend.support.AbstractPostgresIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class ListingMatchingIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ListingRepository listingRepository;

    @Autowired
    private MatchRepository matchRepository;

    @Test
    void donorListingIsFoundNearbyAndMatchedToEveryRecipient() throws Exception {
        UUID donorId = register("Corner Cafe", "cafe@example.com", "donor", 17.3850, 78.4867);
        UUID nearRecipient = register("Hope Shelter", "hope@example.org", "recipient", 17.3900, 78.4867);
        UUID farRecipient = register("Hill Kitchen", "hill@example.org", "recipient", 17.6000, 78.4867);

        MvcResult created = mockMvc.perform(post("/api/listings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"donor_id": "%s", "title": "Veg biryani", "type": "cooked",
                                 "quantity": 25, "lat": 17.3850, "lng": 78.4867}
                                """.formatted(donorId)))
                .andExpect(status().isOk())
                .andReturn();
        String listingId = objectMapper.readTree(created.getResponse().getContentAsString()).path("id").asText();

        assertThat(listingRepository.findById(UUID.fromString(listingId)))
                .hasValueSatisfying(listing -> {
                    assertThat(listing.getUnit()).isEqualTo("servings");
                    assertThat(listing.getExpiresAt()).isAfter(listing.getCreatedAt().plusMinutes(179));
                });

        mockMvc.perform(get("/api/listings").param("lat", "17.3851").param("lng", "78.4867"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.store_available").value(true))
                .andExpect(jsonPath("$.items[0].id").value(listingId))
                .andExpect(jsonPath("$.items[0].distance_km").value(0.01));

        MvcResult matched = mockMvc.perform(post("/api/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"listing_id\": \"" + listingId + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode matches = objectMapper.readTree(matched.getResponse().getContentAsString()).path("matches");

        assertThat(matches).hasSize(2);
        assertThat(matches.get(0).path("recipient_id").asText()).isEqualTo(nearRecipient.toString());
        assertThat(matches.get(1).path("recipient_id").asText()).isEqualTo(farRecipient.toString());
        assertThat(matches.get(0).path("status").asText()).isEqualTo("proposed");
        assertThat(matchRepository.findByListingId(UUID.fromString(listingId))).hasSize(2);

        mockMvc.perform(get("/api/matches").param("user_id", nearRecipient.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1));

        mockMvc.perform(get("/api/listings/donor/" + donorId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id").value(listingId));
    }

    @Test
    void matchingUnknownListingIsNotFound() throws Exception {
        mockMvc.perform(post("/api/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"listing_id\": \"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("LISTING_NOT_FOUND"));

        mockMvc.perform(post("/api/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"listing_id\": \"\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("LISTING_NOT_FOUND"));
    }

    @Test
    void messagesAreListedOldestFirst() throws Exception {
        UUID matchId = UUID.randomUUID();
        UUID senderId = UUID.randomUUID();
        for (String content : new String[] {"Can you pick up at six?", "Yes, on my way"}) {
            mockMvc.perform(post("/api/message")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"match_id": "%s", "sender_id": "%s", "content": "%s"}
                                    """.formatted(matchId, senderId, content)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").isNotEmpty());
        }

        mockMvc.perform(get("/api/messages").param("match_id", matchId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[0].content").value("Can you pick up at six?"));
    }

    @Test
    void blogIsSeededOnFirstRead() throws Exception {
        mockMvc.perform(get("/api/blog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[*].title", hasItems("AI for Food Redistribution", "Food Safety 101")));

        mockMvc.perform(get("/api/blog"))
                .andExpect(jsonPath("$.items.length()").value(2));
    }

    @Test
    void duplicateRegistrationAndWrongPasswordAreRejected() throws Exception {
        register("Corner Cafe", "cafe@example.com", "donor", 17.3850, 78.4867);

        mockMvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Copy", "email": "CAFE@example.com", "password": "secret", "role": "donor"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("EMAIL_ALREADY_REGISTERED"));

        mockMvc.perform(post("/api/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"cafe@example.com\", \"password\": \"wrong\"}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\": \"cafe@example.com\", \"password\": \"secret\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.role").value("donor"));
    }

    private UUID register(String name, String email, String role, double lat, double lng) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "%s", "email": "%s", "password": "secret", "role": "%s",
                                 "lat": %s, "lng": %s}
                                """.formatted(name, email, role, lat, lng)))
                .andExpect(status().isOk())
                .andReturn();
        return UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString()).path("id").asText());
    }
}
