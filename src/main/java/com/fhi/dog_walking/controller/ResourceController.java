package com.fhi.dog_walking.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;

import com.fhi.dog_walking.api.response.ApiResponse;
import com.fhi.dog_walking.service.ResourceService;

/**
 * The five CRUD endpoints of a resource. Subclasses only bind a path with
 * {@code @RequestMapping} and hand over their service.
 *
 * <p>Ids are received as strings: they are hex ObjectIds, validated further down.
 */
public abstract class ResourceController<Q, U, R> 
{
    private final ResourceService<Q, U, ?, R> service;

    protected ResourceController(ResourceService<Q, U, ?, R> service) {
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<R>> create(@RequestBody Q request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(service.create(request)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<R>>> readAll() {
        return ResponseEntity.ok(ApiResponse.success(service.readAll()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<R>> readOne(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(service.readOne(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> update(@PathVariable String id, @RequestBody U update) {
        String updatedId = service.update(id, update);
        return ResponseEntity.ok(ApiResponse.withMessage(service.resourceName() + " Updated: " + updatedId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String id) {
        String deletedId = service.delete(id);
        return ResponseEntity.ok(ApiResponse.withMessage(service.resourceName() + " Deleted: " + deletedId));
    }
}
