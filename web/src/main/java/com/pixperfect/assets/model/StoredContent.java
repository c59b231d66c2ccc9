package com.pixperfect.assets.model;

import lombok.Value;

@Value
public class StoredContent {
    String storageKey;
    byte[] data;
}
