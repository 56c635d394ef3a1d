package com.altar_funds.model;

import com.altar_funds.api.dto.RemoteProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

public record MemberProfile(
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        String email,
        @JsonProperty("church_id") Long churchId,
        @JsonProperty("church_name") String churchName
) {
    @JsonProperty("display_name")
    public String displayName() {
        return ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
    }

    public static MemberProfile from(RemoteProfile remote) {
        RemoteProfile.Church church = remote.church();
        return new MemberProfile(
                remote.firstName(),
                remote.lastName(),
                remote.email(),
                church == null ? null : church.id(),
                church == null ? null : church.name());
    }
}
