// file: engine/src/main/java/io/varlite/engine/gate/GateState.java
package io.varlite.engine.gate;

/** Acknowledgement state of one unit for one session. The only transition is UNACKNOWLEDGED -> ACKNOWLEDGED. */
public enum GateState {
    UNACKNOWLEDGED,
    ACKNOWLEDGED
}
