package com.spinbet.ledgersync.modules.chains.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One page returned by the event source.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventPage {

    private List<NormalizedContractEvent> events = new ArrayList<>();

    private String nextCursor;

    private Long latestLedger;
}
