package com.pixperfect.assets.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialsRequest {
    @NotBlank(message = "Username and password are required")
    @Size(max = 100)
    private String username;

    @NotBlank(message = "Username and password are required")
    @Size(min = 6, message = "Password must be at least 6 characters long")
    private String password;
}
