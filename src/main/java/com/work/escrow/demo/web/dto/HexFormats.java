package com.work.escrow.demo.web.dto;

final class HexFormats {

    static final String HEX_BYTES = "^(0x|0X)?([0-9a-fA-F]{2})+$";

    private HexFormats() {
    }
}
