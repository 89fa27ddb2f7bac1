package com.sheetdoc.app.models;

/**
 * One entry of a batch edit: the address to change and its new raw text.
 * A blank value clears the cell.
 */
public class CellUpdate {
    private String address;
    private String value;

    // Default constructor needed for JSON (de)serialization
    public CellUpdate() {
    }

    public CellUpdate(String address, String value) {
        this.address = address;
        this.value = value;
    }

    public String getAddress() {
        return address;
    }
    public String getValue() {
        return value;
    }
    public void setAddress(String address) {
        this.address = address;
    }
    public void setValue(String value) {
        this.value = value;
    }
}
