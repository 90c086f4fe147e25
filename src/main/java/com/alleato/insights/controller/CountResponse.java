package com.alleato.insights.controller;

public record CountResponse(String action, int count) {}
