package com.flagship.savings_circle.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.roster.Member;
import com.flagship.savings_circle.roster.MemberRole;
import com.flagship.savings_circle.roster.MemberStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class MemberView {

    @JsonProperty("member_id")
    UUID memberId;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("role")
    MemberRole role;

    @JsonProperty("position")
    int position;

    @JsonProperty("status")
    MemberStatus status;

    @JsonProperty("joined_at")
    Instant joinedAt;

    public static MemberView from(Member member) {
        return new MemberView(member.getId(), member.getName(), member.getEmail(), member.getRole(),
                member.getPosition(), member.getStatus(), member.getJoinedAt());
    }
}
