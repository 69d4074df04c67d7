package com.example.chatorchestrator.model;

import lombok.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Filters of a thread search. Unset fields do not filter. The text query matches title,
 * description and tags, case-insensitively.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ThreadSearchCriteria {

    public static final String SORT_LAST_ACTIVITY = "lastActivityAt";
    public static final String SORT_CREATED = "createdAt";
    public static final String SORT_MESSAGE_COUNT = "messageCount";

    private String query;
    @Builder.Default
    private Set<ThreadStatus> statuses = EnumSet.noneOf(ThreadStatus.class);
    @Builder.Default
    private List<String> participants = List.of();
    private Instant createdFrom;
    private Instant createdTo;
    @Builder.Default
    private String sortBy = SORT_LAST_ACTIVITY;
    private boolean ascending;
    private Integer limit;
}
