package com.flairbit.calls.dto;

import com.flairbit.calls.models.SignalKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelaySignalRequest {
    @NotNull
    private SignalKind kind;
    @NotNull
    @Size(max = 65536)
    private String payload;
}
