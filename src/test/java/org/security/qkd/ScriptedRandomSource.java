package org.security.qkd;

/** Replays a fixed bit script, wrapping around at the end. */
final class ScriptedRandomSource implements RandomSource {
    private final int[] script;
    private int pos;

    ScriptedRandomSource(int... script) {
        if (script.length == 0) throw new IllegalArgumentException("script must not be empty");
        this.script = script.clone();
    }

    @Override
    public int nextBit() { return script[pos++ % script.length]; }
}
