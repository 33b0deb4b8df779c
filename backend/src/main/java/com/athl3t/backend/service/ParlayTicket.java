package com.athl3t.backend.service;

import com.athl3t.backend.model.Parlay;
import com.athl3t.backend.model.ParlayLeg;

import java.util.List;

public record ParlayTicket(Parlay parlay, List<ParlayLeg> legs) {
}
