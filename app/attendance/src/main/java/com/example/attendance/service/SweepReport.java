package com.example.attendance.service;

import java.time.LocalDate;

public record SweepReport(LocalDate workDate, int candidates, int created, int skipped, int failed) {}
