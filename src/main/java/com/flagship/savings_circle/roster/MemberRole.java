package com.flagship.savings_circle.roster;

public enum MemberRole {
    ADMIN,
    MEMBER
}
