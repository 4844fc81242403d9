package com.wall.application.port.in;

import com.wall.domain.model.HistoryEntry;
import com.wall.domain.model.Place;
import com.wall.domain.model.Recipe;

import java.util.List;

public interface BrowseLibraryUseCase {
    List<Recipe> recipes();
    List<Place> places();
    List<HistoryEntry> history();
}
