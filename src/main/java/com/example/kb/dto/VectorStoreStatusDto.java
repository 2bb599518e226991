package com.example.kb.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VectorStoreStatusDto {
    private boolean connected;
    private String type;
    private String url;
}
