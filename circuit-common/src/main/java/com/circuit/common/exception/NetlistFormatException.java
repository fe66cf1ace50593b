package com.circuit.common.exception;

/**
 * 网表文本或元件记录格式错误。
 */
public class NetlistFormatException extends CircuitException {

    public NetlistFormatException(String message) {
        super("NETLIST_FORMAT", message);
    }

    public NetlistFormatException(String message, Throwable cause) {
        super("NETLIST_FORMAT", message, cause);
    }
}
