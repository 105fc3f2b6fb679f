package com.smartfix.request.gateway;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

public interface UserDirectory {

    Optional<UserSummary> findUser(String userId);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    class UserSummary {
        private String id;
        private String name;
        private String role;
    }
}
