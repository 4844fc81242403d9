package com.wall.adapter.in.web;

import com.wall.application.port.in.BrowseLibraryUseCase;
import com.wall.domain.model.HistoryEntry;
import com.wall.domain.model.Place;
import com.wall.domain.model.Recipe;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/library")
@Tag(name = "Library", description = "Read-only reference catalogue")
public class LibraryController {

    private final BrowseLibraryUseCase browseLibraryUseCase;

    public LibraryController(BrowseLibraryUseCase browseLibraryUseCase) {
        this.browseLibraryUseCase = browseLibraryUseCase;
    }

    @GetMapping("/recipes")
    @Operation(summary = "List recipes")
    public List<Recipe> recipes() {
        return browseLibraryUseCase.recipes();
    }

    @GetMapping("/places")
    @Operation(summary = "List places")
    public List<Place> places() {
        return browseLibraryUseCase.places();
    }

    @GetMapping("/history")
    @Operation(summary = "List history entries")
    public List<HistoryEntry> history() {
        return browseLibraryUseCase.history();
    }
}
