package com.satyammall.inventoryservice.dto.response;

import com.satyammall.inventoryservice.model.AppUser;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class UserResponse {
    private String email;
    private String name;
    private String role;

    public static UserResponse from(AppUser user) {
        return new UserResponse(user.getEmail(), user.getName(), user.getRole());
    }
}
