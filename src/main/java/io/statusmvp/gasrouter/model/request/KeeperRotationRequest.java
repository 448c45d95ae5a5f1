package io.statusmvp.gasrouter.model.request;

import jakarta.validation.constraints.NotBlank;

public record KeeperRotationRequest(@NotBlank String keeperId) {}
