package com.flagship.savings_circle.roster;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * Identity of a member as shown to callers: enough to name them, nothing more.
 */
@Value
public class MemberSummary {

    @JsonProperty("member_id")
    UUID memberId;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("position")
    int position;

    public static MemberSummary from(Member member) {
        return new MemberSummary(member.getId(), member.getName(), member.getEmail(), member.getPosition());
    }
}
