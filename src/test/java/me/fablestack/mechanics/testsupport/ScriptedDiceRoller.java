package me.fablestack.mechanics.testsupport;

import me.fablestack.mechanics.domain.service.DiceRoller;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Dice roller that returns queued values in order and records the sides asked
 * for. Fails loudly when a test rolls more than it scripted.
 */
public class ScriptedDiceRoller implements DiceRoller {

    private final Deque<Integer> rolls = new ArrayDeque<>();
    private final List<Integer> requestedSides = new ArrayList<>();

    public ScriptedDiceRoller(int... values) {
        enqueue(values);
    }

    public ScriptedDiceRoller enqueue(int... values) {
        for (int value : values) {
            rolls.addLast(value);
        }
        return this;
    }

    @Override
    public int roll(int sides) {
        requestedSides.add(sides);
        Integer next = rolls.pollFirst();
        if (next == null) {
            throw new AssertionError("Unscripted roll of d" + sides);
        }
        if (next < 1 || next > sides) {
            throw new AssertionError("Scripted value " + next + " is not a valid d" + sides + " result");
        }
        return next;
    }

    public List<Integer> getRequestedSides() {
        return requestedSides;
    }

    public int remaining() {
        return rolls.size();
    }
}
