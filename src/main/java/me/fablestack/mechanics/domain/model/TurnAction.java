package me.fablestack.mechanics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured action produced by intent resolution. Only the fields the
 * {@link #type} needs are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TurnAction {

    private TurnActionType type;

    // skill check
    private Integer statValue;
    private Integer skillRank;
    private Difficulty difficulty;
    private String statName;
    private String skillName;

    // combat
    private String actorId;
    private String targetId;
    private Weapon weapon;
    private Integer attackModifier;
    private Boolean advantage;

    // direct damage
    private Integer amount;
    private String source;

    // inventory
    private String itemId;
    private Integer quantityDelta;
    private Long currencyDelta;
}
