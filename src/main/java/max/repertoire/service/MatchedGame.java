package max.repertoire.service;

import max.repertoire.analysis.GameAnalysis;
import max.repertoire.analysis.ParsedGame;
import max.repertoire.common.Color;

/** A game of the user, checked against the repertoire that covers it best. */
public record MatchedGame(ParsedGame game, Color userColor, String repertoireId, String repertoireName, int matchScore,
                          GameAnalysis analysis) {
}
