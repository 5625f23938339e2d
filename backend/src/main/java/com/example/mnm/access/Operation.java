package com.example.mnm.access;

public enum Operation {
    READ,
    WRITE
}
