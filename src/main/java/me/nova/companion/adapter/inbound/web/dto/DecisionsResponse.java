package me.nova.companion.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.nova.companion.domain.model.DecisionRecord;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionsResponse {
    private String userKey;
    private int count;
    private List<DecisionRecord> records;
}
