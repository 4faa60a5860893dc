package com.tazifor.popup.model;

public enum DeviceClass {
    DESKTOP,
    TABLET,
    MOBILE
}
