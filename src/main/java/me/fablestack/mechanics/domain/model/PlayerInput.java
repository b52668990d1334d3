package me.fablestack.mechanics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the player submitted for one turn: the free text that is recorded and
 * shown in restore points, plus any actions already resolved by the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerInput {

    private String text;

    @Builder.Default
    private List<TurnAction> actions = new ArrayList<>();
}
