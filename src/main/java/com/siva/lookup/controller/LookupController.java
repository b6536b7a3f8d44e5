// controller/LookupController.java
package com.siva.lookup.controller;

import com.siva.lookup.service.LookupService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/lookup")
public class LookupController {
  private final LookupService service;

  public LookupController(LookupService service) {
    this.service = service;
  }

  static record EntryResponse(String table, int id, String name) {}
  static record PreloadResponse(String table, int size) {}

  // ---- TABLES ----
  @GetMapping
  public Map<String, Integer> tables() {
    return service.tables();
  }

  // ---- NAME -> ID (find-or-create) ----
  @GetMapping("/{table}/id")
  public EntryResponse idFor(@PathVariable("table") String table, @RequestParam("name") String name) {
    // blank names are rejected by the cache
    return new EntryResponse(table, service.idFor(table, name), name);
  }

  // ---- ID -> NAME ----
  @GetMapping("/{table}/name/{id}")
  public EntryResponse nameFor(@PathVariable("table") String table, @PathVariable("id") int id) {
    return new EntryResponse(table, id, service.nameFor(table, id));
  }

  // ---- INVALIDATE ----
  @DeleteMapping("/{table}/cache")
  public ResponseEntity<Void> invalidate(@PathVariable("table") String table,
                                         @RequestParam(name = "name", required = false) String name,
                                         @RequestParam(name = "id", required = false) Integer id) {
    if ((name == null || name.isBlank()) == (id == null))
      throw new IllegalArgumentException("exactly one of 'name' or 'id' is required");
    if (id != null) service.invalidate(table, id);
    else service.invalidate(table, name);
    return ResponseEntity.noContent().build();
  }

  // ---- PRELOAD ----
  @PostMapping("/{table}/preload")
  public PreloadResponse preload(@PathVariable("table") String table) {
    return new PreloadResponse(table, service.preload(table));
  }
}
