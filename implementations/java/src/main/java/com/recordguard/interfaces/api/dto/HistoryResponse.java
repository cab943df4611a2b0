package com.recordguard.interfaces.api.dto;

import com.recordguard.domain.model.SessionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryResponse {

    private UUID sessionId;
    private List<Entry> exchanges;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        private String request;
        private String response;
    }

    public static HistoryResponse from(UUID sessionId, List<SessionState.Exchange> exchanges) {
        return HistoryResponse.builder()
            .sessionId(sessionId)
            .exchanges(exchanges.stream()
                .map(exchange -> new Entry(exchange.request(), exchange.response()))
                .collect(Collectors.toList()))
            .build();
    }
}
