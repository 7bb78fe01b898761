package com.connectfood.backend.modules.listing.presentation;

import java.util.UUID;

import com.connectfood.backend.modules.geo.domain.Coordinate;
import com.connectfood.backend.modules.listing.application.ListingService;
import com.connectfood.backend.modules.listing.application.NearbyListingResult;
import com.connectfood.backend.modules.listing.application.NearbyListingSearch;
import com.connectfood.backend.modules.listing.domain.Listing;
import com.connectfood.backend.modules.listing.presentation.dto.CreateListingRequest;
import com.connectfood.backend.modules.listing.presentation.dto.CreateListingResponse;
import com.connectfood.backend.modules.listing.presentation.dto.ListingDtoMapper;
import com.connectfood.backend.modules.listing.presentation.dto.ListingListResponse;
import com.connectfood.backend.modules.listing.presentation.dto.NearbyListingsResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/listings")
public class ListingController {

    private final ListingService listingService;
    private final NearbyListingSearch nearbyListingSearch;

    public ListingController(ListingService listingService, NearbyListingSearch nearbyListingSearch) {
        this.listingService = listingService;
        this.nearbyListingSearch = nearbyListingSearch;
    }

    @PostMapping
    public ResponseEntity<CreateListingResponse> createListing(@Valid @RequestBody CreateListingRequest request) {
        Listing listing = listingService.createListing(request);
        return ResponseEntity.ok(new CreateListingResponse(listing.getId()));
    }

    @Operation(
            summary = "Nearby listings",
            description = """
                    Unexpired listings with status `available` or `claimed` within `radius_km` of the \
                    query point, closest first, at most 100. `count` is the total before truncation. \
                    When the store cannot be read the response is empty with `store_available=false`.
                    """
    )
    @GetMapping
    public ResponseEntity<NearbyListingsResponse> nearbyListings(
            @RequestParam(name = "lat") double lat,
            @RequestParam(name = "lng") double lng,
            @RequestParam(name = "radius_km", defaultValue = "${connectfood.search.default-radius-km:10.0}") double radiusKm
    ) {
        if (lat < -90 || lat > 90 || lng < -180 || lng > 180) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_COORDINATE");
        }
        NearbyListingResult result = nearbyListingSearch.search(new Coordinate(lat, lng), radiusKm);
        return ResponseEntity.ok(ListingDtoMapper.toNearbyListResponse(result));
    }

    @GetMapping("/donor/{donorId}")
    public ResponseEntity<ListingListResponse> donorListings(@PathVariable("donorId") UUID donorId) {
        return ResponseEntity.ok(new ListingListResponse(
                listingService.getDonorListings(donorId).stream()
                        .map(ListingDtoMapper::toResponse)
                        .toList()
        ));
    }
}
