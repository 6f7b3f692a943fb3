package com.couponbot.pipeline.application.controller;

import com.couponbot.pipeline.application.controller.coupon.CouponController;
import com.couponbot.pipeline.application.controller.coupon.mapper.CouponResponseMapperImpl;
import com.couponbot.pipeline.domain.coupon.CouponQueryService;
import com.couponbot.pipeline.domain.exceptions.CouponNotFoundException;
import java.util.List;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static com.couponbot.pipeline.test.fixtures.CouponFixtures.validUnpostedCouponBuilder;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CouponController.class)
@Import(CouponResponseMapperImpl.class)
class CouponControllerTest {

    private static final String COUPONS_PATH = "/api/v1/coupons";

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    CouponQueryService couponQueryService;

    @SneakyThrows
    @Test
    void shouldReturnCouponById() {
        given(couponQueryService.getCoupon(1L)).willReturn(validUnpostedCouponBuilder().build());

        mockMvc.perform(get(COUPONS_PATH + "/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id", is(1)))
                .andExpect(jsonPath("$.name", is("X Pro")))
                .andExpect(jsonPath("$.code", is("ABC123")))
                .andExpect(jsonPath("$.valid", is(true)))
                .andExpect(jsonPath("$.posted", is(false)));
    }

    @SneakyThrows
    @Test
    void shouldReturn404ForUnknownCoupon() {
        given(couponQueryService.getCoupon(404L)).willThrow(CouponNotFoundException.of(404L));

        mockMvc.perform(get(COUPONS_PATH + "/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title", is("Coupon Not Found")))
                .andExpect(jsonPath("$.code", is(ErrorCodes.COUPON_NOT_FOUND)));
    }

    @SneakyThrows
    @Test
    void shouldReturn400ForNonNumericId() {
        mockMvc.perform(get(COUPONS_PATH + "/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is(ErrorCodes.BAD_REQUEST)));
    }

    @SneakyThrows
    @Test
    void shouldListCouponsFilteredBySource() {
        given(couponQueryService.listCoupons("Generic")).willReturn(List.of(validUnpostedCouponBuilder().build()));

        mockMvc.perform(get(COUPONS_PATH).param("source", "Generic"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].source", is("Generic")));
    }
}
