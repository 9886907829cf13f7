package com.largomodo.dotshop.emit;

import java.util.List;

/**
 * C for Arduino sketches: arrays live in flash via {@code PROGMEM} and are read back with
 * {@code pgm_read_byte}.
 */
public class ArduinoEmitter extends CEmitter {

    public static final String ID = "arduino";

    @Override
    public String targetId() {
        return ID;
    }

    @Override
    protected List<String> includes() {
        return List.of("Arduino.h");
    }

    @Override
    protected String storage() {
        return " PROGMEM";
    }
}
