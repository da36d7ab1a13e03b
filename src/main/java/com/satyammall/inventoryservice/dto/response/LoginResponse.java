package com.satyammall.inventoryservice.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {
    private boolean success;
    private UserResponse user;
    private String message;

    public static LoginResponse ok(UserResponse user) {
        return new LoginResponse(true, user, null);
    }

    public static LoginResponse rejected(String message) {
        return new LoginResponse(false, null, message);
    }
}
