package io.intellixity.quarry.examples.web;

import io.intellixity.quarry.examples.service.DatasourceService;
import io.intellixity.quarry.examples.service.DatasourceView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/datasources")
public final class DatasourceController {
  private final DatasourceService datasources;

  public DatasourceController(DatasourceService datasources) {
    this.datasources = datasources;
  }

  @GetMapping
  public List<DatasourceView> all() {
    return datasources.all();
  }

  @GetMapping("/by-id/{id}")
  public DatasourceView byId(@PathVariable("id") long id) {
    return datasources.byId(id);
  }

  @GetMapping("/{type}/{id}")
  public DatasourceView get(@PathVariable("type") String type, @PathVariable("id") long id) {
    return datasources.get(type, id);
  }

  @GetMapping("/{type}/{id}/eager")
  public DatasourceView eager(@PathVariable("type") String type, @PathVariable("id") long id) {
    return datasources.eager(type, id);
  }

  @GetMapping("/{type}/by-name")
  public ResponseEntity<DatasourceView> byName(@PathVariable("type") String type,
                                               @RequestParam("name") String name,
                                               @RequestParam(value = "schema", required = false) String schema,
                                               @RequestParam("database") String database) {
    return datasources.byName(type, name, schema, database)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
