package com.questrail.kitchen.print.model;

public enum Alignment
{
    LEFT,
    CENTER,
    RIGHT
}
