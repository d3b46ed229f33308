package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.grant.UserGrant;

import java.time.Instant;
import java.util.List;

/**
 * One page of user grants.
 *
 * @param totalCount      matches before paging
 * @param latestSequence  journal position the read view had reached
 * @param latestTimestamp commit time of that position, null if nothing was projected yet
 */
public record UserGrantList(List<UserGrant> grants, long totalCount, long latestSequence,
                            Instant latestTimestamp) {
}
