package com.example.mnm.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ContractDtos {

    public record StatusChangeRequest(@JsonProperty("status") Object status) {}

    public record RatingRequest(
            @JsonAlias("nota") Object rating,
            @JsonAlias("comentario") String comment
    ) {}

    public record StatusChangeResponse(
            String message,
            String status,
            String timestamp
    ) {}

    public record RatingResponse(
            String message,
            int rating,
            String comment,
            String timestamp
    ) {}
}
