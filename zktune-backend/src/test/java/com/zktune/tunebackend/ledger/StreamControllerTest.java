package com.zktune.tunebackend.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zktune.tunebackend.ledger.dto.StreamRequest;
import com.zktune.tunebackend.track.dto.PublishRequest;
import com.zktune.tunebackend.user.dto.RegisterRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class StreamControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    private String artist;
    private String fan;

    @BeforeEach
    void setUp() throws Exception {
        String run = UUID.randomUUID().toString().substring(0, 8);
        artist = "artist-" + run;
        fan = "fan-" + run;

        mockMvc.perform(post("/api/creators")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(new RegisterRequest(artist, "Artist", "profiles/a.json"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.account").value(artist));
    }

    private long publish(long price) throws Exception {
        PublishRequest request = new PublishRequest(artist, "Night Drive", "audio/night.mp3", "covers/night.jpg", price, null);
        String body = mockMvc.perform(post("/api/tracks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.royaltyBasisPoints").value(3000))
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("id").asLong();
    }

    @Test
    void shouldStreamAfterPayingAndReportEscrow() throws Exception {
        long id = publish(1000);

        mockMvc.perform(post("/api/tracks/{id}/stream", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(new StreamRequest(fan, 1000))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.audioRef").value("audio/night.mp3"))
                .andExpect(jsonPath("$.settled").value(true))
                .andExpect(jsonPath("$.royaltyShare").value(300));

        mockMvc.perform(get("/api/tracks/{id}/gate", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.escrowBalance").value(300))
                .andExpect(jsonPath("$.issuedCount").value(1))
                .andExpect(jsonPath("$.grantedTo[0]").value(fan));

        mockMvc.perform(get("/api/tracks/{id}/access", id).param("consumer", fan))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.granted").value(true));

        mockMvc.perform(get("/api/consumers/{account}/plays", fan))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].trackId").value(id));

        mockMvc.perform(get("/api/events").param("trackId", String.valueOf(id)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalItems").value(4))
                .andExpect(jsonPath("$.totalPages").value(1))
                .andExpect(jsonPath("$.items[0].type").value("TRACK_PUBLISHED"))
                .andExpect(jsonPath("$.items[3].type").value("PLAYED"));
    }

    @Test
    void shouldMapLedgerRefusalsToStatusCodes() throws Exception {
        long id = publish(1000);

        mockMvc.perform(post("/api/tracks/{id}/stream", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(new StreamRequest(fan, 10))))
                .andExpect(status().isPaymentRequired());

        mockMvc.perform(post("/api/tracks/{id}/stream", 0)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(new StreamRequest(fan, 1000))))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/creators")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(new RegisterRequest(artist, "Again", ""))))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/tracks/{id}/escrow/withdraw", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(Map.of("caller", fan))))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/tracks/{id}/escrow/withdraw", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(Map.of("caller", artist))))
                .andExpect(status().isConflict());
    }

    @Test
    void shouldWithdrawAccruedRoyalty() throws Exception {
        long id = publish(2000);

        mockMvc.perform(post("/api/tracks/{id}/stream", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(new StreamRequest(fan, 2000))))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/tracks/{id}/escrow/withdraw", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(Map.of("caller", artist))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(600));

        mockMvc.perform(get("/api/creators/{account}/payouts", artist))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPaidOut").value(600));
    }

    @Test
    void shouldRejectInvalidPublishRequests() throws Exception {
        PublishRequest negative = new PublishRequest(artist, "Bad", "audio/bad.mp3", "", -1L, null);
        mockMvc.perform(post("/api/tracks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(negative)))
                .andExpect(status().isBadRequest());

        PublishRequest stranger = new PublishRequest("stranger-" + artist, "Bad", "audio/bad.mp3", "", 1L, null);
        mockMvc.perform(post("/api/tracks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsBytes(stranger)))
                .andExpect(status().isNotFound());
    }
}
