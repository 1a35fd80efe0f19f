package com.example.inboxsync.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimulatedMessageRequest {

    @NotBlank
    private String accountId;

    /** External chat id; a random stored chat of the account is used when blank. */
    private String chatId;

    private String text;

    @Min(1)
    @Max(50)
    private int count = 1;
}
