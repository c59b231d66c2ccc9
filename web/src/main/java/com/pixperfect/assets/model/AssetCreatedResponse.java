package com.pixperfect.assets.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssetCreatedResponse {
    private Long id;
    private String storageKey;
    private String address;
    private String message;
}
