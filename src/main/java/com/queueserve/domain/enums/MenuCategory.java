package com.queueserve.domain.enums;

public enum MenuCategory {
    MAIN,
    SNACK,
    DRINK,
    BEVERAGE,
    DESSERT
}
